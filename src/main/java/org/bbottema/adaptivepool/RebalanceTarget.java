package org.bbottema.adaptivepool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pool sizes the leader wants one instance to move to, stored under {@code rebalance:{instanceId}}. Each round is
 * applied once by the instance it is meant for.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
class RebalanceTarget {
	/**
	 * Epoch milliseconds of the leader's rebalancing round.
	 */
	@JsonProperty("round") private final long round;
	@JsonProperty("share") private final double share;
	@JsonProperty("targets") @NotNull private final Map<String, Integer> targetSizesByKind;

	@JsonCreator
	RebalanceTarget(@JsonProperty("round") long round,
			@JsonProperty("share") double share,
			@JsonProperty("targets") @Nullable Map<String, Integer> targetSizesByKind) {
		this.round = round;
		this.share = share;
		this.targetSizesByKind = targetSizesByKind != null
				? Collections.unmodifiableMap(new TreeMap<>(targetSizesByKind))
				: Collections.<String, Integer>emptyMap();
	}
}
