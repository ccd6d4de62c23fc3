// file: src/main/java/io/kvbridge/core/policy/ExistsPolicy.java
package io.kvbridge.core.policy;

/**
 * Record existence requirement for a write.
 *  - IGNORE:            create or merge into an existing record.
 *  - CREATE:            fail if the record exists.
 *  - UPDATE:            fail if the record does not exist; merge bins.
 *  - REPLACE:           fail if the record does not exist; drop old bins.
 *  - CREATE_OR_REPLACE: create, or drop old bins of an existing record.
 */
public enum ExistsPolicy { IGNORE, CREATE, UPDATE, REPLACE, CREATE_OR_REPLACE }
