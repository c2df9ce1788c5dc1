package org.stianloader.pyresolve.marker;

import org.jetbrains.annotations.NotNull;

/**
 * A single compatibility tag triple of a wheel (PEP 425), e.g. <code>cp311-abi3-manylinux_2_17_x86_64</code>.
 */
public final record WheelTag(@NotNull String interpreter, @NotNull String abi, @NotNull String platform) {

    @Override
    @NotNull
    public String toString() {
        return this.interpreter + '-' + this.abi + '-' + this.platform;
    }
}
