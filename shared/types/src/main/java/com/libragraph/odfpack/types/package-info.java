/**
 * Pure Java value types shared across all odfpack modules.
 *
 * <p>Packaging kinds, recognized ODF media types and part states.
 * This module has no dependencies.
 */
package com.libragraph.odfpack.types;
