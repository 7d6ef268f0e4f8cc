/**
 * Error and context model shared by every codec.
 *
 * <pre>
 *   value parsing    → ParserException   (what)
 *   codec            → TxParsingException (what + where)
 *   stream failure   → TxReadException / TxWriteException (no where)
 * </pre>
 *
 * <p>Everything that crosses the codec contract is a
 * {@link com.questrail.txfile.error.TxCodecException}.</p>
 */
package com.questrail.txfile.error;
