package jump.email.watch.entity;

public enum LabelFilterBehavior {
    INCLUDE,
    EXCLUDE
}
