package org.lsst.cti.mask;

/**
 * How far the mask around a cosmic ray hit is grown. Charge from a cosmic
 * ray trails behind it during clocking, so the mask extends towards the
 * readout register (parallel), away from the readout electronics (serial)
 * and diagonally between the two.
 */
public class CosmicRayBuffers {

    public static final int DEFAULT_PARALLEL_BUFFER = 10;
    public static final int DEFAULT_SERIAL_BUFFER = 10;
    public static final int DEFAULT_DIAGONAL_BUFFER = 3;

    private final int parallelBuffer;
    private final int serialBuffer;
    private final int diagonalBuffer;

    public CosmicRayBuffers(int parallelBuffer, int serialBuffer, int diagonalBuffer) {
        if (parallelBuffer < 0 || serialBuffer < 0 || diagonalBuffer < 0) {
            throw new IllegalArgumentException("Cosmic ray buffers must not be negative: " + parallelBuffer + ", " + serialBuffer + ", " + diagonalBuffer);
        }
        this.parallelBuffer = parallelBuffer;
        this.serialBuffer = serialBuffer;
        this.diagonalBuffer = diagonalBuffer;
    }

    public static CosmicRayBuffers defaults() {
        return new CosmicRayBuffers(DEFAULT_PARALLEL_BUFFER, DEFAULT_SERIAL_BUFFER, DEFAULT_DIAGONAL_BUFFER);
    }

    /**
     * Read the buffers from the system properties
     * <code>org.lsst.cti.cosmicRayParallelBuffer</code>,
     * <code>org.lsst.cti.cosmicRaySerialBuffer</code> and
     * <code>org.lsst.cti.cosmicRayDiagonalBuffer</code>, falling back to the
     * defaults.
     *
     * @return The configured buffers
     */
    public static CosmicRayBuffers fromSystemProperties() {
        return new CosmicRayBuffers(
                Integer.getInteger("org.lsst.cti.cosmicRayParallelBuffer", DEFAULT_PARALLEL_BUFFER),
                Integer.getInteger("org.lsst.cti.cosmicRaySerialBuffer", DEFAULT_SERIAL_BUFFER),
                Integer.getInteger("org.lsst.cti.cosmicRayDiagonalBuffer", DEFAULT_DIAGONAL_BUFFER));
    }

    public int getParallelBuffer() {
        return parallelBuffer;
    }

    public int getSerialBuffer() {
        return serialBuffer;
    }

    public int getDiagonalBuffer() {
        return diagonalBuffer;
    }

    @Override
    public String toString() {
        return "CosmicRayBuffers{" + "parallel=" + parallelBuffer + ", serial=" + serialBuffer + ", diagonal=" + diagonalBuffer + '}';
    }
}
