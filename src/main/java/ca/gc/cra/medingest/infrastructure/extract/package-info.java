/**
 * Format extractors. Each turns one file into an
 * {@link ca.gc.cra.medingest.domain.document.ExtractedDocument}; parser failures degrade confidence and leave a
 * bracketed marker in the content rather than throwing.
 */
package ca.gc.cra.medingest.infrastructure.extract;
