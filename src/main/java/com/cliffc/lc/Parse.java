package com.cliffc.lc;

import com.cliffc.lc.util.SB;
import org.jetbrains.annotations.NotNull;

/*** an implementation of the untyped lambda calculus
 *
 *  GRAMMAR:
 *  prog = term END
 *  term = atom [' ' atom]*        // Application-as-adjacent, left associative
 *  atom = ( term )                // Grouping
 *  atom = λ id . term             // Abstraction; body extends as far right as possible
 *  atom = id                      // Variable
 *  id   = [^()λ. ]+               // Anything but the punctuation and space
 *
 *  Exactly one space separates atoms.  No comments, no numbers.
 *
 *  A Parse is a single-use cursor over one program; nothing is shared between
 *  parses.
 */
public class Parse {
  public static final char LAMBDA = 'λ';

  private final String _buf;    // Program source
  private int _x;               // Parser cursor

  private Parse( String prog ) { _buf = prog; }

  /** Parse a complete program.
   *  @param prog source text
   *  @return the term
   *  @throws SyntaxErr if the source does not match the grammar, or has
   *  trailing junk after a complete term, or nests too deeply for the Java
   *  stack */
  public static @NotNull Term parse( @NotNull String prog ) {
    Parse P = new Parse(prog);
    Term t;
    try {
      t = P.term();
    } catch( StackOverflowError soe ) {
      throw P.err("Nesting too deep");
    }
    if( P._x < P._buf.length() ) throw P.err("Syntax error; trailing junk");
    return t;
  }

  // Parse a term: atoms separated by single spaces, folded left into applications
  private Term term() {
    Term t = atom();
    while( peek(' ') )
      t = new Term.App(t,atom());
    return t;
  }

  // Parse an atom
  private Term atom() {
    if( _x == _buf.length() ) throw err("Missing term");
    char c = _buf.charAt(_x);
    // Parens
    if( c=='(' ) {
      _x++;
      return require(term(),')');
    }
    // Parse a Lambda
    if( c==LAMBDA ) {
      _x++;
      String id = id();
      if( id==null ) throw err("Missing binder name");
      require('.');
      return new Term.Lam(id,term());
    }
    // Variable
    String id = id();
    if( id==null ) throw err("Unexpected '"+c+"'");
    return new Term.Var(id);
  }

  // Parse an identifier, or null if none
  private String id() {
    int start = _x;
    while( _x < _buf.length() && isId(_buf.charAt(_x)) ) _x++;
    return start==_x ? null : _buf.substring(start,_x);
  }

  static boolean isId( char c ) { return c!='(' && c!=')' && c!=LAMBDA && c!='.' && c!=' '; }

  private boolean peek( char c ) {
    if( _x == _buf.length() || _buf.charAt(_x)!=c ) return false;
    _x++;
    return true;
  }
  private void require( char c ) { if( !peek(c) ) throw err("Missing '"+c+"'"); }
  private <T> T require( T t, char c ) { require(c); return t; }

  private SyntaxErr err( String msg ) { return new SyntaxErr(_buf,_x,msg); }

  @Override public String toString() { return new SB().p(_buf.substring(0,_x)).p(" <*> ").p(_buf.substring(_x)).toString(); }
}
