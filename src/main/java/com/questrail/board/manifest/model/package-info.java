/**
 * Document-side model of a board manifest.
 * =============================================================================
 *
 * <p>These types mirror the parts of a IIIF Presentation 3 manifest the board
 * codec reads and writes:</p>
 *
 * <pre>
 *   Manifest
 *     items[0]: Canvas (the surface)
 *       items: AnnotationPage (painting)       -> board items
 *       annotations: AnnotationPage (supplementing)
 *         linking annotations                  -> connections
 *         commenting annotations               -> notes
 *     structures: Range                        -> groups
 *     service: BoardMarker, BoardViewport
 * </pre>
 *
 * <p>The model is closed: labels always use {@link
 * com.questrail.board.manifest.model.LanguageMap}, bodies are one of two
 * variants, and vendor data is expressed as
 * {@link com.questrail.board.manifest.model.ExtensionRecord} variants. Shape
 * normalization happens once, when JSON is read.</p>
 */
package com.questrail.board.manifest.model;
