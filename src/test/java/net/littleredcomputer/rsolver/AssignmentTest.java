package net.littleredcomputer.rsolver;

import org.junit.Test;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class AssignmentTest {
    @Test
    public void initiallyEverythingThawedAndFalse() {
        Assignment a = Assignment.allThawed(3);
        assertThat(a.frozenCount(), is(0));
        assertThat(a.thawedCount(), is(3));
        assertThat(a.values(), contains(false, false, false));
        assertThat(a.toString(), is("..."));
    }

    @Test
    public void freezingCopies() {
        Assignment parent = Assignment.allThawed(3);
        Assignment t = parent.freezeNext(true);
        Assignment f = parent.freezeNext(false);
        assertThat(parent, is(Assignment.allThawed(3)));
        assertThat(t.frozenCount(), is(1));
        assertThat(t.value(0), is(true));
        assertThat(f.value(0), is(false));
        assertThat(f.isFrozen(0), is(true));
        assertThat(f.isFrozen(1), is(false));
        Assignment tf = t.freezeNext(false);
        assertThat(tf.toString(), is("10."));
        assertThat(t.toString(), is("1.."));
        assertThat(tf.frozenCount() + tf.thawedCount(), is(tf.size()));
    }

    @Test
    public void fullyFrozen() {
        Assignment a = Assignment.of(true, false);
        assertThat(a.hasThawed(), is(false));
        assertThat(a.frozenPrefix(), is("10"));
        assertThat(a, is(Assignment.allThawed(2).freezeNext(true).freezeNext(false)));
        assertThat(a, not(Assignment.allThawed(2).freezeNext(true)));
    }

    @Test
    public void ofCopiesItsArgument() {
        boolean[] v = {true};
        Assignment a = Assignment.of(v);
        v[0] = false;
        assertThat(a.value(0), is(true));
    }

    @Test(expected = IllegalStateException.class)
    public void nothingLeftToFreeze() {
        Assignment.of(true).freezeNext(false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeSize() {
        Assignment.allThawed(-1);
    }
}
