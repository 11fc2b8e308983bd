package com.questrail.board.manifest.model;

/**
 * Body of an {@link Annotation}.
 *
 * <p>The board codec understands exactly two body shapes:</p>
 * <ul>
 *   <li>{@link SpecificResource}: a reference to other content, used by
 *       painting and linking annotations</li>
 *   <li>{@link TextualBody}: inline text, used by commenting annotations</li>
 * </ul>
 *
 * Any other body read from a manifest is treated as absent.
 */
public sealed interface AnnotationBody
        permits SpecificResource, TextualBody
{
    String type();
}
