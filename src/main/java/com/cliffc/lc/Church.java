package com.cliffc.lc;

import static com.cliffc.lc.Parse.parse;

/** Church-encoded booleans, pairs and naturals.

 * Most are parsed from source; a few are built directly as Terms, since they
 * embed another combinator.  Decoders accept normal forms from
 * {@link Reduce}; since stuck arguments are left unreduced, {@link #to_int}
 * finishes reducing them as it walks the numeral.
 */
public abstract class Church {
  // Booleans select one of two arguments
  public static final Term TRUE  = parse("λx.λy.x");
  public static final Term FALSE = parse("λx.λy.y");
  public static final Term AND   = parse("λp.λq.p q p");
  public static final Term OR    = parse("λp.λq.p p q");
  public static final Term NOT   = parse("λp.λa.λb.p b a");
  public static final Term IF    = parse("λp.λa.λb.p a b");

  // Pairs
  public static final Term PAIR  = parse("λa.λb.λs.s a b");
  public static final Term FST   = new Term.Lam("p",new Term.App(new Term.Var("p"),TRUE ));
  public static final Term SND   = new Term.Lam("p",new Term.App(new Term.Var("p"),FALSE));

  // Naturals: n applies f n times
  public static final Term ZERO  = parse("λf.λx.x");
  public static final Term SUCC  = parse("λn.λf.λx.f (n f x)");
  public static final Term PLUS  = parse("λm.λn.λf.λx.m f (n f x)");
  public static final Term MULT  = parse("λm.λn.λf.m (n f)");
  public static final Term ISZERO= new Term.Lam("n",
                                     new Term.App(new Term.App(new Term.Var("n"),
                                                               new Term.Lam("x",FALSE)),
                                                  TRUE));

  // Build the numeral for n
  public static Term num( int n ) {
    if( n < 0 ) throw new IllegalArgumentException("No negative numerals: "+n);
    Term body = new Term.Var("x");
    for( int i=0; i<n; i++ )
      body = new Term.App(new Term.Var("f"),body);
    return new Term.Lam("f",new Term.Lam("x",body));
  }

  // Apply a combinator to arguments, left to right
  public static Term ap( Term fun, Term... args ) {
    for( Term arg : args ) fun = new Term.App(fun,arg);
    return fun;
  }

  /** @return TRUE or FALSE if {@code t} is alpha-equivalent to one, else null */
  public static Boolean to_bool( Term t ) {
    if( t.alpha_eq(TRUE ) ) return Boolean.TRUE;
    if( t.alpha_eq(FALSE) ) return Boolean.FALSE;
    return null;
  }

  // Decode a numeral with the default budget
  public static int to_int( Term t ) { return to_int(new Reduce(),t); }

  /** Decode a numeral: {@code λf.λx.f (f ... x)}.  Arguments of the f
   *  applications are reduced with {@code R} as they are reached.  Each such
   *  reduction is a separate {@link Reduce#reduce} call and gets the full
   *  budget of {@code R}; the budget does not span the whole decode.
   *  @return the count of f applications, or -1 if not a numeral
   *  @throws StepLimit if reducing any one argument runs out of budget */
  public static int to_int( Reduce R, Term t ) {
    if( !(t instanceof Term.Lam lf) || !(lf._body instanceof Term.Lam lx) ) return -1;
    String f = lf._name, x = lx._name;
    if( f.equals(x) ) return -1; // Shadowed f
    int n=0;
    Term body = R.reduce(lx._body);
    while( body instanceof Term.App app && app._fun instanceof Term.Var fv && fv._name.equals(f) ) {
      n++;
      body = R.reduce(app._arg);
    }
    return body instanceof Term.Var xv && xv._name.equals(x) ? n : -1;
  }
}
