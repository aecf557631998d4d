/**
 * Spring Boot auto-configuration for event synchronization.
 *
 * @see eventsync.spring.boot.EventSyncAutoConfiguration
 * @see eventsync.spring.boot.EventSyncProperties
 */
package eventsync.spring.boot;
