package com.ocadapter.service.impl.fallback;

import com.ocadapter.model.UnifiedResponse;
import com.ocadapter.service.impl.dto.DecisionContext;
import org.springframework.stereotype.Component;

/**
 * Final fallback: a fixed apology in the language guessed from the user's message.
 *
 * <p>Detection only looks at Unicode ranges. Any kana means Japanese; otherwise any CJK
 * ideograph means Chinese; everything else is English. Mixed-script text follows those rules
 * as they are.</p>
 */
@Component
public class ApologyResponder implements TerminalStage {

    static final String ENGLISH = "I'm unable to process this request right now. Please try again later.";
    static final String CHINESE = "我現在無法處理這個請求，請稍後再試。";
    static final String JAPANESE = "申し訳ございませんが、現在このリクエストを処理できません。";

    enum Script { JAPANESE, CHINESE, OTHER }

    @Override
    public String name() {
        return "apology";
    }

    @Override
    public UnifiedResponse respond(DecisionContext context) {
        return UnifiedResponse.chat(apologyFor(context.userMessage()));
    }

    static String apologyFor(String userMessage) {
        return switch (detect(userMessage)) {
            case JAPANESE -> JAPANESE;
            case CHINESE -> CHINESE;
            case OTHER -> ENGLISH;
        };
    }

    static Script detect(String text) {
        if (text == null) {
            return Script.OTHER;
        }
        boolean ideograph = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c >= '\u3040' && c <= '\u309f') || (c >= '\u30a0' && c <= '\u30ff')) {
                return Script.JAPANESE;
            }
            if (c >= '\u4e00' && c <= '\u9fa5') {
                ideograph = true;
            }
        }
        return ideograph ? Script.CHINESE : Script.OTHER;
    }
}
