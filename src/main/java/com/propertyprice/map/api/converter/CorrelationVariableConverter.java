package com.propertyprice.map.api.converter;

import com.propertyprice.map.domain.model.CorrelationVariable;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

@Component
public class CorrelationVariableConverter implements Converter<String, CorrelationVariable> {

    @Override
    public CorrelationVariable convert(String source) {
        return CorrelationVariable.fromValue(source.trim());
    }
}
