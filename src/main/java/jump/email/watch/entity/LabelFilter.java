package jump.email.watch.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Label inclusion/exclusion list narrowing which messages trigger notifications.
 * An empty INCLUDE list matches everything.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LabelFilter {
    public static final String INBOX = "INBOX";

    @Column(name = "label_ids", length = 1000)
    @Convert(converter = StringListConverter.class)
    private List<String> labelIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "label_filter_behavior")
    private LabelFilterBehavior behavior = LabelFilterBehavior.INCLUDE;

    public static LabelFilter inbox() {
        return new LabelFilter(new ArrayList<>(List.of(INBOX)), LabelFilterBehavior.INCLUDE);
    }

    public static LabelFilter of(List<String> labelIds, LabelFilterBehavior behavior) {
        if (labelIds == null || labelIds.isEmpty()) {
            return inbox();
        }
        return new LabelFilter(new ArrayList<>(labelIds),
            behavior != null ? behavior : LabelFilterBehavior.INCLUDE);
    }

    public boolean matches(Collection<String> messageLabels) {
        if (labelIds == null || labelIds.isEmpty()) {
            return true;
        }
        boolean anyListed = messageLabels != null && messageLabels.stream().anyMatch(labelIds::contains);
        return behavior == LabelFilterBehavior.EXCLUDE ? !anyListed : anyListed;
    }

    /**
     * Gmail's history.list accepts a single label id; returns it when the filter can be pushed down.
     */
    public String singleIncludedLabel() {
        if (behavior == LabelFilterBehavior.INCLUDE && labelIds != null && labelIds.size() == 1) {
            return labelIds.get(0);
        }
        return null;
    }
}
