/**
 * Command-line entry points: {@code medingest ingest} and {@code medingest search}.
 * <p>Arguments are {@code key=value} pairs plus flags; precedence is CLI over YAML ({@code config=FILE}) over
 * embedded defaults. Commands return an {@link ca.gc.cra.medingest.api.ExitCode} instead of throwing.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.medingest.api;
