package co.cqlgen.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where generated DTO classes go.
 *
 * @param packageName Java package of the DTO classes
 * @param location    source root the DTOs are written under, resolved against the output directory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelGenerationTarget(
    @JsonProperty("Package") @JsonAlias({"package"}) String packageName,
    @JsonProperty("Location") @JsonAlias({"location"}) String location
) {
  public ModelGenerationTarget {
    if (location == null || location.isBlank()) location = ".";
  }
}
