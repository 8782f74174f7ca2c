package com.propertyprice.map.api.converter;

import com.propertyprice.map.domain.model.TrendPeriod;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds "monthly", "quarterly" and "yearly" request values.
 */
@Component
public class TrendPeriodConverter implements Converter<String, TrendPeriod> {

    @Override
    public TrendPeriod convert(String source) {
        return TrendPeriod.fromValue(source.trim());
    }
}
