package com.thetalimited.pansharpen.pca;

// output of a forward transform: data in component space and the mapping to undo it

public final class PcaResult
{
    private final ImageCube projected;
    private final PcaMapping mapping;

    PcaResult(ImageCube projected, PcaMapping mapping) {
        this.projected = projected;
        this.mapping = mapping;
    }

    public ImageCube getProjected() { return projected; }
    public PcaMapping getMapping() { return mapping; }
}
