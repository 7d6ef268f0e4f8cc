/**
 * Command-line entry points.
 *
 * <p>This package is a <strong>wiring component only</strong>: it parses
 * arguments, opens files, and maps outcomes to {@link com.questrail.txfile.tool.ExitCode}s.
 * All format behavior lives in the codecs.</p>
 */
package com.questrail.txfile.tool;
