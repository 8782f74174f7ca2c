package com.propertyprice.map.api.converter;

import com.propertyprice.map.domain.model.AnalysisMode;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds hyphenated analysis mode values such as "growth-decline".
 */
@Component
public class AnalysisModeConverter implements Converter<String, AnalysisMode> {

    @Override
    public AnalysisMode convert(String source) {
        return AnalysisMode.fromValue(source.trim());
    }
}
