package warden.core.model.health;

/**
 * Liveness of one gateway dependency.
 *
 * @param up whether the dependency answered the probe successfully
 * @param detail a short human readable description, e.g. {@code Connected} or {@code Disconnected (timeout)}
 */
public record DependencyHealth(boolean up, String detail) {

    public static DependencyHealth connected() {
        return new DependencyHealth(true, "Connected");
    }

    public static DependencyHealth disconnected(String reason) {
        return new DependencyHealth(false, "Disconnected (" + reason + ")");
    }
}
