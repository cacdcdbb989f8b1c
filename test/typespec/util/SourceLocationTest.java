package typespec.util;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class SourceLocationTest {

	@Test
	public void combineSameLine() {
		SourceLocation a = new SourceLocation(4, 6, 2, 2, 3, 5);
		SourceLocation b = new SourceLocation(10, 12, 2, 2, 9, 11);
		assertThat(a.combine(b), is(new SourceLocation(4, 12, 2, 2, 3, 11)));
		assertThat(b.combine(a), is(a.combine(b)));
	}

	@Test
	public void combineAcrossLines() {
		SourceLocation a = new SourceLocation(10, 14, 2, 2, 5, 9);
		SourceLocation b = new SourceLocation(20, 22, 3, 3, 1, 3);
		assertThat(a.combine(b), is(new SourceLocation(10, 22, 2, 3, 5, 3)));
	}

	@Test
	public void unknownIsNeutral() {
		SourceLocation a = new SourceLocation(0, 3, 1, 1, 1, 4);
		assertThat(SourceLocation.unknown().combine(a), is(a));
		assertThat(a.combine(SourceLocation.unknown()), is(a));
		assertThat(SourceLocation.unknown().isUnknown(), is(true));
		assertThat(SourceLocation.unknown().prettyString(), is("?:?"));
	}

	@Test
	public void prettyStringIsLineAndColumn() {
		assertThat(new SourceLocation(30, 31, 4, 4, 7, 8).prettyString(), is("4:7"));
	}

	@Test
	public void ordersByLineThenColumn() {
		SourceLocation early = new SourceLocation(0, 1, 1, 1, 9, 10);
		SourceLocation late = new SourceLocation(20, 21, 2, 2, 1, 2);
		assertThat(early.compareTo(late) < 0, is(true));
		assertThat(late.compareTo(early) > 0, is(true));
		assertThat(SourceLocation.unknown().compareTo(early) < 0, is(true));
	}
}
