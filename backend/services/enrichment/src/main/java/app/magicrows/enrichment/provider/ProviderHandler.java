package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.domain.OutputSpecification;

import java.util.Optional;

public interface ProviderHandler {

    ProviderType type();

    RawResponse complete(String model, String prompt, double temperature, OutputContract contract);

    ParsedOutput parse(RawResponse response, OutputSpecification output, OutputContract contract);

    Optional<TokenUsage> usage(RawResponse response);
}
