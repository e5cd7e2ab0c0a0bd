/**
 * EmojiSelectionResolver.java
 *
 * 将用户在输入框中输入或粘贴的文本解析为目标 emoji 列表。
 * 优先在目录中匹配（忽略 U+FE0F 变体选择符），按首次出现的位置排序并去重；
 * 目录中一个都没有匹配到时，把输入中每个包含“其他符号”类码点的字素簇当作临时条目，
 * 以应对不同输入法或平台输出的变体序列。
 */
package club.ppmc.emojiforge.service;

import club.ppmc.emojiforge.model.EmojiInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class EmojiSelectionResolver {

    private static final String VARIATION_SELECTOR_16 = "\uFE0F";
    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    public List<EmojiInfo> resolve(String input, List<EmojiInfo> catalog) {
        if (!StringUtils.hasText(input)) {
            return List.of();
        }

        String normalizedInput = normalize(input);
        record Match(int index, EmojiInfo emoji) {}
        List<Match> matches = new ArrayList<>();
        for (EmojiInfo emoji : catalog) {
            String normalizedEmoji = normalize(emoji.character());
            if (normalizedEmoji.isEmpty()) {
                continue;
            }
            int index = normalizedInput.indexOf(normalizedEmoji);
            if (index >= 0) {
                matches.add(new Match(index, emoji));
            }
        }

        if (!matches.isEmpty()) {
            return distinctByCharacter(
                    matches.stream()
                            .sorted(Comparator.comparingInt(Match::index))
                            .map(Match::emoji)
                            .collect(Collectors.toList()));
        }

        List<EmojiInfo> typed = new ArrayList<>();
        Matcher matcher = GRAPHEME_CLUSTER.matcher(input);
        while (matcher.find()) {
            String element = matcher.group();
            if (looksLikeEmoji(element)) {
                typed.add(new EmojiInfo(element, "Selected Emoji", "user-input", toCodepoints(element)));
            }
        }
        return distinctByCharacter(typed);
    }

    /**
     * 以 "_" 连接的大写十六进制码点，至少4位，例如 "1F600" 或 "2764_FE0F"。
     */
    static String toCodepoints(String element) {
        return element.codePoints().mapToObj(cp -> String.format("%04X", cp)).collect(Collectors.joining("_"));
    }

    private static boolean looksLikeEmoji(String element) {
        if (element.isBlank()) {
            return false;
        }
        return element.codePoints().anyMatch(cp -> Character.getType(cp) == Character.OTHER_SYMBOL);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.replace(VARIATION_SELECTOR_16, "");
    }

    private static List<EmojiInfo> distinctByCharacter(List<EmojiInfo> emojis) {
        Map<String, EmojiInfo> unique = new LinkedHashMap<>();
        for (EmojiInfo emoji : emojis) {
            unique.putIfAbsent(emoji.character(), emoji);
        }
        return List.copyOf(unique.values());
    }
}
