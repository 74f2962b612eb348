package com.sahd.search.service;

import java.math.BigDecimal;
import org.springframework.stereotype.Component;

@Component
public class SearchSizePolicy {
    private final SearchProperties properties;

    public SearchSizePolicy(SearchProperties properties) {
        this.properties = properties;
    }

    public int resolve(Object requested) {
        BigDecimal value = toDecimal(requested);
        if (value == null || value.signum() <= 0 || value.stripTrailingZeros().scale() > 0) {
            return properties.getDefaultSize();
        }
        if (value.compareTo(BigDecimal.valueOf(properties.getMaxSize())) > 0) {
            return properties.getMaxSize();
        }
        return Math.max(1, value.intValue());
    }

    private static BigDecimal toDecimal(Object requested) {
        if (requested instanceof Boolean) {
            return null;
        }
        if (requested instanceof Number number) {
            double asDouble = number.doubleValue();
            if (Double.isNaN(asDouble) || Double.isInfinite(asDouble)) {
                return null;
            }
            return new BigDecimal(number.toString());
        }
        if (requested instanceof CharSequence text) {
            try {
                return new BigDecimal(text.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
