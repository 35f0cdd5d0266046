package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicType;

/**
 * Maps a {@link MosaicType} to its strategy.
 */
public final class MosaicStrategies {

    private static final MosaicStrategy COLOR = new ColorStrategy();
    private static final MosaicStrategy HUE = new HueStrategy();
    private static final MosaicStrategy PHOTO = new PhotoStrategy();

    private MosaicStrategies() {}

    public static MosaicStrategy forType(MosaicType type) {
        return switch (type) {
            case COLOR -> COLOR;
            case HUE -> HUE;
            case PHOTO -> PHOTO;
        };
    }

    /**
     * Strategy for one build. A PHOTO request that caps seed reuse gets its own instance;
     * everything else shares the stateless ones.
     */
    public static MosaicStrategy forRequest(MosaicRequest request) {
        MosaicOptions options = request.options();
        if (request.mosaicType() == MosaicType.PHOTO && options.limitsSeedReuse()) {
            return new PhotoStrategy(options.maxImageReuse());
        }
        return forType(request.mosaicType());
    }
}
