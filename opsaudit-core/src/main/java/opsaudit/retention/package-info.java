/**
 * Daily retention sweep of expired interactions.
 */
package opsaudit.retention;
