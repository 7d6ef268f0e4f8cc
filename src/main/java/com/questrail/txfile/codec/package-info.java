/**
 * Transaction File Codecs
 * =============================================================================
 *
 * <p>This package defines the <strong>codec contract</strong> shared by the
 * three on-disk representations of a transaction record set:</p>
 *
 * <ul>
 *   <li>a fixed, length-prefixed binary frame format</li>
 *   <li>an order-independent {@code KEY: value} text format</li>
 *   <li>a header-validated, fixed-column CSV format</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   InputStream
 *        → TxFormat.codec().parse
 *            → List&lt;TxRecord&gt;
 *                → TxFormat.codec().write
 *                    → OutputStream
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Codecs never open, close or retry streams.</li>
 *   <li>Codecs never log. Every failure is reported as a
 *       {@link com.questrail.txfile.error.TxCodecException}.</li>
 *   <li>All byte-level and line-level mechanics live in
 *       {@code com.questrail.txfile.codec.impl}.</li>
 * </ul>
 */
package com.questrail.txfile.codec;
