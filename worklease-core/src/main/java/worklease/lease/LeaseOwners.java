package worklease.lease;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builders for lease-owner identities.
 */
public final class LeaseOwners {
  private static final Logger logger = Logger.getLogger(LeaseOwners.class.getName());

  private LeaseOwners() {
  }

  /**
   * Returns {@code <hostname>-<pid>}. Two workers in one JVM share this value, so give
   * each its own identity with {@link #unique()} when they must not adopt each other's leases.
   */
  public static String hostAndPid() {
    return hostName() + "-" + ProcessHandle.current().pid();
  }

  /**
   * Returns {@code <hostname>-<pid>-<8 hex chars>}, distinct per call.
   */
  public static String unique() {
    return hostAndPid() + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      logger.log(Level.FINE, "Cannot resolve local host name, using 'localhost'", e);
      return "localhost";
    }
  }
}
