package com.sharedsolve.config;

import com.sharedsolve.coordination.NodeRole;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds {@code sharedsolve.coordination.role}, accepting both role names and the
 * {@code normal}/{@code parent}/{@code child} names older deployments use.
 */
@Component
@ConfigurationPropertiesBinding
public class NodeRoleConverter implements Converter<String, NodeRole> {

    @Override
    public NodeRole convert(String source) {
        return NodeRole.from(source);
    }
}
