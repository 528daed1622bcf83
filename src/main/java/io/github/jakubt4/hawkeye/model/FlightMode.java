package io.github.jakubt4.hawkeye.model;

/**
 * Flight modes of the drone state machine.
 *
 * <pre>
 *   DISARMED &lt;-&gt; ARMED -&gt; GUIDED -&gt; {RTL | LAND} -&gt; DISARMED
 *   any -&gt; EMERGENCY -&gt; DISARMED (explicit disarm only)
 * </pre>
 */
public enum FlightMode {
    DISARMED,
    ARMED,
    GUIDED,
    RTL,
    LAND,
    EMERGENCY
}
