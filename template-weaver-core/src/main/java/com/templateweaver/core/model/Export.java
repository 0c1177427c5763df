package com.templateweaver.core.model;

import com.templateweaver.core.node.DocumentNode;

/**
 * Cross-stack export of an output value.
 *
 * @param name export name, may contain directives; {@code null} when the document omits it
 */
public record Export(DocumentNode name) {
}
