package vhdlgen.syntax;

public abstract sealed class VHDLExpr extends VHDLElement permits VarRef, ConstString, ExprList {}
