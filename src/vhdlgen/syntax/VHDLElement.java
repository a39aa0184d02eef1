package vhdlgen.syntax;

import java.io.IOException;

/**
 * Any VHDL syntax element. Each element can carry a single comment.
 * The set of element kinds is closed, see {@link VHDLEmitter} for the rendering of each kind.
 */
public abstract sealed class VHDLElement permits VHDLType, VHDLExpr, VHDLDecl, SeqStmt, ConcStmt, Architecture, Entity {
  private String comment = "";

  /**
   * Sets the comment of this element, replacing any previous one.
   * @param comment The comment text without the '--' prefix; may contain line breaks. null clears the comment.
   */
  public void setComment(String comment) { this.comment = (comment == null) ? "" : comment; }

  public String getComment() { return comment; }

  public boolean hasComment() { return !comment.isEmpty(); }

  /**
   * Writes this element to a text sink.
   * @param out The sink. Write failures of the sink are passed on unchanged.
   * @param level The nesting level to start at (0 for top level).
   */
  public void emit(Appendable out, int level) throws IOException { new VHDLEmitter(out).emit(this, level); }
}
