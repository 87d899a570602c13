package io.surfworks.rangeforge.core.range;

/**
 * A channel whose interval collapsed to a single value.
 *
 * @param channel Channel index (flat position for full-shaped ranges)
 * @param value   The value the channel is stuck at
 */
public record StuckChannel(int channel, double value) {

    @Override
    public String toString() {
        return "(" + channel + ", " + value + ")";
    }
}
