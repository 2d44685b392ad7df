package com.demanglekit.core.printer;

import com.demanglekit.core.model.Node;

/**
 * Thrown when a node lacks a payload or child its tag requires.
 *
 * <p>Never escapes {@link NodePrinter#render}: the render is abandoned and yields the
 * empty string.
 */
class MalformedNodeException extends RuntimeException {

    MalformedNodeException(Node node, String message) {
        super(node.kind().kindName() + ": " + message);
    }
}
