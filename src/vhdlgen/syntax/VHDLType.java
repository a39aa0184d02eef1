package vhdlgen.syntax;

public abstract sealed class VHDLType extends VHDLElement permits ScalarType {}
