/**
 * Spring Boot auto-configuration for the connector control plane.
 */
package relay.spring.boot;
