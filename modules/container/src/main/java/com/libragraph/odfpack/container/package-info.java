/**
 * ODF package core: {@link com.libragraph.odfpack.container.OdfContainer} and the
 * exceptions it throws.
 *
 * <p>Sub-packages hold the in-memory part store, the backends parts are read
 * from (ZIP file, folder, none) and the writers used on save.
 */
package com.libragraph.odfpack.container;
