package org.bbottema.adaptivepool.util;

import org.junit.Test;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TimeoutTest {

	@Test
	public void testSecondsRoundedUp() {
		assertThat(new Timeout(1500, MILLISECONDS).toSecondsRoundedUp()).isEqualTo(2);
		assertThat(new Timeout(30, SECONDS).toSecondsRoundedUp()).isEqualTo(30);
		assertThat(Timeout.NONE.toSecondsRoundedUp()).isEqualTo(0);
	}

	@Test
	public void testHasElapsed() {
		final Timeout timeout = Timeout.ofSeconds(5);
		assertThat(timeout.hasElapsed(1000, 5999)).isFalse();
		assertThat(timeout.hasElapsed(1000, 6000)).isTrue();
		assertThat(Timeout.NONE.hasElapsed(1000, 1000)).isTrue();
	}

	@Test
	public void testNegativeDurationRejected() {
		assertThatThrownBy(() -> new Timeout(-1, SECONDS)).isInstanceOf(IllegalArgumentException.class);
	}
}
