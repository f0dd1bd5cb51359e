package app.magicrows.enrichment.service;

import app.magicrows.enrichment.contract.OutputContract;
import app.magicrows.enrichment.provider.AbstractProviderHandler;
import app.magicrows.enrichment.provider.ProviderProfile;
import app.magicrows.enrichment.provider.RawResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Handler that answers from a function of the prompt instead of calling a provider.
 */
class ScriptedProviderHandler extends AbstractProviderHandler {

    private final Function<String, String> responder;
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    ScriptedProviderHandler(ProviderProfile profile, Function<String, String> responder) {
        super(profile, new ObjectMapper(), false);
        this.responder = responder;
    }

    @Override
    protected RawResponse send(String model, String prompt, double temperature, OutputContract contract) {
        prompts.add(prompt);
        return new RawResponse(responder.apply(prompt), contract != null, model, "stop", false, 10, 5, 15, null);
    }

    List<String> prompts() {
        return prompts;
    }
}
