package tech.yump.auditlog.config;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import tech.yump.auditlog.audit.AuditLevel;

/**
 * Binds {@code audit.level} from a level name or its numeric value (0-3).
 */
@Component
@ConfigurationPropertiesBinding
public class AuditLevelConverter implements Converter<String, AuditLevel> {

    @Override
    public AuditLevel convert(@NonNull String source) {
        return AuditLevel.fromValue(source);
    }
}
