/**
 * Spring mail integration for the travel notification handlers.
 */
package courier.spring.mail;
