/**
 * Spring Boot auto-configuration binding {@code opsaudit.*} properties to a running
 * {@link opsaudit.AuditPipeline}.
 */
package opsaudit.spring.boot;
