package tech.yump.auditlog;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.auditlog.config.AuditLogProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(AuditLogProperties.class)
public class LiteAuditApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteAuditApplication.class, args);
    log.info(">>> LiteAudit Application Started <<<");
  }
}
