package org.croniq.notifications;

/**
 * Outcome counts of one dispatch call.
 *
 * @param skipped bindings filtered out (unverified channel, trigger flag off, no sender for the type)
 */
public record DispatchReport(int delivered, int failed, int skipped) {

    public static final DispatchReport EMPTY = new DispatchReport(0, 0, 0);

    public int attempted() {
        return delivered + failed;
    }
}
