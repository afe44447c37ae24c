package jump.email.watch.model;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public static HealthStatus fromPassingRatio(double ratio) {
        if (ratio >= 0.8) {
            return HEALTHY;
        }
        if (ratio >= 0.5) {
            return DEGRADED;
        }
        return UNHEALTHY;
    }
}
