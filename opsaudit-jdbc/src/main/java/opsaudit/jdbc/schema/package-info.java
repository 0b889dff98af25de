/**
 * Start-up schema verification and opt-in schema provisioning.
 */
package opsaudit.jdbc.schema;
