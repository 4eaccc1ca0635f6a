/**
 * Spring Boot auto-configuration for worklease.
 *
 * @see worklease.spring.boot.WorkLeaseAutoConfiguration
 * @see worklease.spring.boot.WorkLeaseProperties
 */
package worklease.spring.boot;
