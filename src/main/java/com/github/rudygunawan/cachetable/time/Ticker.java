package com.github.rudygunawan.cachetable.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>Entry timestamps ({@code createdOn}, {@code accessedOn}) and the idle-time arithmetic of the
 * expiration scan are all taken from a table's ticker. Tests can supply a ticker they control to
 * drive expiration without relying on the system clock.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * CacheTable<String, User> table = CacheTableBuilder.newBuilder()
 *     .ticker(ticker)
 *     .build("users");
 *
 * table.add("user1", 10, TimeUnit.MINUTES, user);
 * ticker.advance(11, TimeUnit.MINUTES);
 *
 * table.cleanUp();
 * assertFalse(table.exists("user1"));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * <p>Must behave like {@link System#nanoTime()}: monotonic and unrelated to wall-clock time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return the default ticker
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
