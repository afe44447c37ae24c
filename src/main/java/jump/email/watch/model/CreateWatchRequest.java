package jump.email.watch.model;

import jump.email.watch.entity.LabelFilterBehavior;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateWatchRequest {
    private List<String> labelIds;
    private LabelFilterBehavior labelFilterBehavior;
}
