/**
 * Inspection and manual replay of permanently failed tasks.
 */
package courier.dead;
