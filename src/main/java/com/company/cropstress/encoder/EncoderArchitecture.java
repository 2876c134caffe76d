package com.company.cropstress.encoder;

import com.company.cropstress.config.EncoderProperties;
import com.company.cropstress.domain.enums.VegetationIndex;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Layer dimensions of the encoder. Every conv block but the last is followed by 2x2 max pooling.
 */
@Value
@Builder
@JsonPropertyOrder({"inputChannels", "convChannels", "denseUnits", "spatialDim", "lstmUnits", "embeddingDim"})
public class EncoderArchitecture {
    int inputChannels;
    List<Integer> convChannels;
    int denseUnits;
    int spatialDim;
    int lstmUnits;
    int embeddingDim;

    public static EncoderArchitecture from(EncoderProperties properties) {
        return EncoderArchitecture.builder()
                .inputChannels(VegetationIndex.values().length)
                .convChannels(IntStream.of(properties.getConvChannels()).boxed().toList())
                .denseUnits(properties.getDenseUnits())
                .spatialDim(properties.getSpatialDim())
                .lstmUnits(properties.getLstmUnits())
                .embeddingDim(properties.getEmbeddingDim())
                .build();
    }

    public int lastConvChannels() {
        return convChannels.get(convChannels.size() - 1);
    }

    public boolean poolsAfter(int block) {
        return block < convChannels.size() - 1;
    }

    @Override
    public String toString() {
        return "conv" + convChannels + " dense" + denseUnits + " spatial" + spatialDim
                + " bilstm" + lstmUnits + " embedding" + embeddingDim;
    }
}
