/**
 * Spring Boot auto-configuration for journal queries, offsets and Micrometer metrics.
 */
package eventlog.spring.boot;
