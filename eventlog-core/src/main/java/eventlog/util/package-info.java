/**
 * Small threading helpers shared by the poller.
 */
package eventlog.util;
