package devicevault.pipeline.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

/**
 * Identity written into the lock key: {@code <pid>@<host>}.
 */
public record LockOwner(long pid, String host) {

    private static final Logger log = LoggerFactory.getLogger(LockOwner.class);

    public static LockOwner current() {
        return new LockOwner(ProcessHandle.current().pid(), localHostName());
    }

    /**
     * Parse a stored identity. Empty if the value was not written by a scheduler.
     */
    public static Optional<LockOwner> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int at = value.indexOf('@');
        if (at <= 0 || at == value.length() - 1) {
            return Optional.empty();
        }
        try {
            return Optional.of(new LockOwner(Long.parseLong(value.substring(0, at)), value.substring(at + 1)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean sameHost(LockOwner other) {
        return host.equalsIgnoreCase(other.host);
    }

    static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, using 'localhost': {}", e.getMessage());
            return "localhost";
        }
    }

    @Override
    public String toString() {
        return pid + "@" + host;
    }
}
