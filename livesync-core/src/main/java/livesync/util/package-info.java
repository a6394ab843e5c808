/**
 * Threading helpers shared by the engine components.
 */
package livesync.util;
