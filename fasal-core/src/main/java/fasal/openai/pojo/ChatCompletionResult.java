package fasal.openai.pojo;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.List;

@Data
public class ChatCompletionResult {
    private String id;
    private String model;
    private List<ChatCompletionChoice> choices;

    @Data
    public static class ChatCompletionChoice {
        private Integer index;
        private ChatMessage message;
        @SerializedName("finish_reason")
        private String finishReason;
    }
}
