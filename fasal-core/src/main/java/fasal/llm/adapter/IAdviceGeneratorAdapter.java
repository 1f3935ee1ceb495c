package fasal.llm.adapter;

import fasal.common.exception.AdviceUnavailableException;
import fasal.llm.pojo.AdviceContext;

public interface IAdviceGeneratorAdapter {

    /**
     * @return a farmer-facing narrative for the diagnosis
     * @throws AdviceUnavailableException when the generator cannot answer
     */
    String generateAdvice(AdviceContext context);

    default boolean isEnabled() {
        return true;
    }
}
