/**
 * Domain record model shared by all transaction file formats.
 *
 * <p>Types in this package carry data and the display/parse rules of their
 * individual values. They have no knowledge of framing, line grammar or
 * stream I/O; those live in {@code com.questrail.txfile.codec}.</p>
 */
package com.questrail.txfile.model;
