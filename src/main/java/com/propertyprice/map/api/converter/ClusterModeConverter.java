package com.propertyprice.map.api.converter;

import com.propertyprice.map.domain.model.ClusterMode;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds "geographic", "price" and "size" request values.
 */
@Component
public class ClusterModeConverter implements Converter<String, ClusterMode> {

    @Override
    public ClusterMode convert(String source) {
        return ClusterMode.fromValue(source.trim());
    }
}
