/**
 * In-memory collaborators for the identity services.
 *
 * <p>Kept in src/main so applications and other modules can use them from their own tests.
 */
package com.tessera.identity.testing;
