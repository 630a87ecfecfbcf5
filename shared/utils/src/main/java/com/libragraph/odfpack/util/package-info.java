/**
 * Shared utilities for all odfpack modules.
 *
 * <p>Contains {@link com.libragraph.odfpack.util.PartPaths} (part name normalization) and the
 * {@link com.libragraph.odfpack.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer).
 * No framework dependencies, pure Java.
 */
package com.libragraph.odfpack.util;
