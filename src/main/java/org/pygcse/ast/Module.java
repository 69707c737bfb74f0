package org.pygcse.ast;

import java.util.List;

/**
 * Root of a parsed program.
 */
public record Module(List<Stmt> body)
{
}
