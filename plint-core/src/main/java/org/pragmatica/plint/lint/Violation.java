package org.pragmatica.plint.lint;

import org.pragmatica.plint.document.SyntaxNode;

/// Offending element found by a rule, before it is turned into a [Diagnostic].
///
/// Holds a reference into the document; it does not own or copy the element.
public record Violation(SyntaxNode element, String description, String explanation) {}
