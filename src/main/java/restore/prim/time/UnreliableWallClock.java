package restore.prim.time;

import java.time.Instant;

/**
 * A wall clock can tell you the date and time.  Most ways of measuring wall
 * clock time (such as Java's <code>Instant.now()</code>) are unreliable: a
 * computer's notion of wall clock time can be wrong.  It can also change in
 * unexpected ways, with sudden jumps forward and backward.
 *
 * <p>Backup timestamps and share link expirations are read from this clock, so
 * callers that need strictly increasing timestamps must enforce that themselves
 * (see {@link restore.bkup.impls.BackupEngine}).
 */
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;
}
