package org.lsst.cti.extract;

import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs how long an extraction took.
 */
class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    static <T> T execute(Supplier<T> supplier, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, supplier, message, args);
    }

    static <T> T execute(Level logLevel, Supplier<T> supplier, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return supplier.get();
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    private static Object[] append(Object[] args, Object arg) {
        Object[] result = new Object[args.length + 1];
        System.arraycopy(args, 0, result, 0, args.length);
        result[args.length] = arg;
        return result;
    }
}
