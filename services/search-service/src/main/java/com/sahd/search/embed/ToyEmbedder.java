package com.sahd.search.embed;

import com.sahd.search.cache.CacheKeyUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import org.springframework.stereotype.Component;

@Component
public class ToyEmbedder {
    private final int dimension;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.dimension = Math.max(1, properties.getDimension());
    }

    public List<Double> embed(String text) {
        String hash = CacheKeyUtil.sha256(text == null ? "" : text);
        SplittableRandom random = new SplittableRandom(Long.parseUnsignedLong(hash.substring(0, 16), 16));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            values[i] = random.nextDouble(-1.0, 1.0);
            sumSquares += values[i] * values[i];
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }

    public int dimension() {
        return dimension;
    }
}
