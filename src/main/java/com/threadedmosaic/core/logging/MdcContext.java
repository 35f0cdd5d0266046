package com.threadedmosaic.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for mosaic builds. Callers set them on entry and {@link #clear()} in a finally block.
 */
public final class MdcContext {

    public static final String OPERATION_ID = "operationId";
    public static final String TILE_INDEX = "tileIndex";
    public static final String MOSAIC_TYPE = "mosaicType";

    private MdcContext() {}

    public static void setOperation(String operationId, String mosaicType) {
        MDC.put(OPERATION_ID, operationId);
        MDC.put(MOSAIC_TYPE, mosaicType);
    }

    public static void setTile(String operationId, int tileIndex) {
        MDC.put(OPERATION_ID, operationId);
        MDC.put(TILE_INDEX, String.valueOf(tileIndex));
    }

    public static void clearTile() {
        MDC.remove(TILE_INDEX);
    }

    public static void clear() {
        MDC.remove(OPERATION_ID);
        MDC.remove(TILE_INDEX);
        MDC.remove(MOSAIC_TYPE);
    }
}
