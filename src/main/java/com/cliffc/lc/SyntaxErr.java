package com.cliffc.lc;

import com.cliffc.lc.util.SB;

// Parse failure.  All-or-nothing: no partial term comes with it.
public class SyntaxErr extends IllegalArgumentException {
  public final String _prog;    // Source being parsed
  public final int _x;          // Offset of the failure
  public final String _msg;     // Printable error message, minus code context

  SyntaxErr( String prog, int x, String msg ) {
    super(errLocMsg(prog,x,msg));
    _prog = prog;
    _x = x;
    _msg = msg;
  }

  // Message, the source line, and a caret under the offending column
  private static String errLocMsg( String prog, int x, String msg ) {
    // find line start
    int a=x;
    while( a > 0 && prog.charAt(a-1) != '\n' ) --a;
    // find line end
    int b=x;
    while( b < prog.length() && prog.charAt(b) != '\n' ) b++;
    SB sb = new SB().p("lc:").p(x-a).p(':').p(msg).nl();
    sb.p(prog.substring(a,b)).nl();
    for( int i=a; i<x; i++ )
      sb.p(' ');
    return sb.p('^').toString();
  }
}
