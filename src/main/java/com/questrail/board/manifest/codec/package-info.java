/**
 * Board Manifest Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> between the editable
 * board model ({@code com.questrail.board.api}) and the document model
 * ({@code com.questrail.board.manifest.model}).</p>
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li>Item: painting annotation on the surface canvas, target
 *       {@code <surfaceId>#xywh=x,y,w,h}, body referencing the resource</li>
 *   <li>Note: commenting annotation with a plain-text body</li>
 *   <li>Connection: linking annotation, {@code target} = source resource id,
 *       {@code body.source} = destination resource id, type as body label</li>
 *   <li>Group: range in {@code structures} listing member resource ids</li>
 *   <li>Viewport and board marker: extension records on the manifest root</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   BoardState
 *        -> BoardManifestEncoder  (ids resolved, geometry encoded)
 *            -> Manifest
 *                -> ManifestJsonWriter  (JSON text)
 *
 *   JSON text
 *        -> ManifestJsonReader  (shape normalized)
 *            -> Manifest
 *                -> BoardManifestDecoder
 *                    -> BoardState
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Only the encoder and decoder touch document structure; everything else
 *       exchanges {@code BoardState} values</li>
 *   <li>Identifier resolution is scoped to a single pass</li>
 *   <li>Within a decode pass every item is decoded before any connection</li>
 * </ul>
 */
package com.questrail.board.manifest.codec;
