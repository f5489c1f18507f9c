package works.jsonapi.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A {@link JsonInclude.Include#CUSTOM CUSTOM} inclusion filter that omits a
 * {@code data} member when it is null or {@link PrimaryData.Absent Absent}.
 * <p>
 * Unlike {@link JsonInclude.Include#NON_EMPTY NON_EMPTY}, this still writes
 * an empty array, which in JSON:API means "an empty collection" rather than "nothing".
 * <p>
 * Jackson calls {@link #equals} with each property value and omits the
 * property when it returns true.
 */
public final class AbsentDataFilter {
	@Override
	public boolean equals(Object obj) {
		return obj == null || obj instanceof PrimaryData.Absent;
	}

	@Override
	public int hashCode() {
		return 0;
	}
}
