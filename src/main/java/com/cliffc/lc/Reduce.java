package com.cliffc.lc;

import org.jetbrains.annotations.NotNull;

/** Capture-avoiding substitution and beta reduction to normal form.

 * The strategy is fixed: reduce the head of an application; if it becomes a
 * lambda, substitute the (unreduced) argument into the body and keep going.
 * If the head is stuck, the application is returned with its argument
 * untouched.  Lambda bodies are reduced under the binder.  This is neither
 * call-by-value nor full leftmost-outermost normal order: arguments of stuck
 * applications are never reduced.

 * Reduction need not terminate, e.g. {@code (λx.x x) (λx.x x)}.  Each Reduce
 * carries a budget of beta steps; running out (or running out of Java stack)
 * throws {@link StepLimit}.  A Reduce counts steps for one call at a time and
 * is not meant to be shared between threads.
 */
public class Reduce {
  private final int _max_steps; // Beta step budget; <= 0 is unbounded
  private int _steps;           // Beta steps taken by the current/last reduce

  public Reduce() { this(LC.MAX_STEPS); }
  public Reduce( int max_steps ) { _max_steps = max_steps; }

  public int steps() { return _steps; }
  public int max_steps() { return _max_steps; }

  // Reduce to normal form under the default budget
  public static Term go( @NotNull Term t ) { return new Reduce().reduce(t); }

  /** Reduce to normal form.
   *  @param t term to reduce
   *  @return the normal form
   *  @throws StepLimit if the budget runs out first */
  public @NotNull Term reduce( @NotNull Term t ) {
    _steps = 0;
    try {
      return _reduce(t);
    } catch( StackOverflowError soe ) {
      throw new StepLimit(_steps,_max_steps,"Stack overflow");
    }
  }

  private Term _reduce( Term t ) {
    if( t instanceof Term.Var ) return t; // Already normal
    if( t instanceof Term.Lam lam ) {
      Term body = _reduce(lam._body);
      return body==lam._body ? lam : new Term.Lam(lam._name,body);
    }
    if( t instanceof Term.App app ) {
      Term fun = _reduce(app._fun);
      if( !(fun instanceof Term.Lam lam) ) // Stuck; argument is left alone
        return fun==app._fun ? app : new Term.App(fun,app._arg);
      // Beta step
      if( _max_steps > 0 && _steps == _max_steps )
        throw new StepLimit(_steps,_max_steps,"Out of steps");
      _steps++;
      Term rez = subst(lam._name,app._arg,lam._body);
      if( LC.DEBUG ) LC.p(rez,"beta "+_steps+": ("+lam+" "+app._arg+") => "+rez);
      return _reduce(rez);
    }
    throw LC.TODO("Unknown term "+t.getClass());
  }

  /** Capture-avoiding substitution, {@code t[name := rep]}.

   *  A lambda re-binding {@code name} shadows it and is returned as-is.  A
   *  lambda whose binder is free in {@code rep} is renamed first: a fresh
   *  binder is chosen from seed "x", the old binder is renamed through the
   *  body, and only then is {@code rep} substituted into the renamed body.
   *  The fresh binder avoids {@code name} and the free names of both
   *  {@code rep} and the body, so nothing can be captured and the renamed
   *  occurrences are never themselves replaced.
   *  @param name name being replaced
   *  @param rep  replacement term
   *  @param t    target term
   *  @return t with every free {@code name} replaced by {@code rep} */
  public static @NotNull Term subst( @NotNull String name, @NotNull Term rep, @NotNull Term t ) {
    if( t instanceof Term.Var var )
      return var._name.equals(name) ? rep : var;
    if( t instanceof Term.App app )
      return new Term.App(subst(name,rep,app._fun),subst(name,rep,app._arg));
    if( t instanceof Term.Lam lam ) {
      if( lam._name.equals(name) ) return lam; // Shadowed
      if( rep.occurs_free(lam._name) ) {        // Would capture; rename then substitute
        String x = Term.fresh("x",new Term.App(new Term.App(rep,lam._body),new Term.Var(name)));
        Term body = subst(lam._name,new Term.Var(x),lam._body);
        return new Term.Lam(x,subst(name,rep,body));
      }
      return new Term.Lam(lam._name,subst(name,rep,lam._body));
    }
    throw LC.TODO("Unknown term "+t.getClass());
  }
}
