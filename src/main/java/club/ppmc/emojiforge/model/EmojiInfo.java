/**
 * EmojiInfo.java
 *
 * 表示后端目录中的一个 emoji 条目。由 EmojiCatalogService 从 emoji_list 事件解析得到，
 * 也可能由 EmojiSelectionResolver 根据用户直接输入的字符临时构造。
 */
package club.ppmc.emojiforge.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param character emoji 字符本身。
 * @param name 名称，缺省为 "Unknown"。
 * @param category 分类。
 * @param codepoints 以 "_" 连接的十六进制码点，例如 "1F600"，用于生成输出文件名。
 */
public record EmojiInfo(
        @JsonProperty("char") String character, String name, String category, String codepoints) {

    @Override
    public String toString() {
        return character + " " + name;
    }
}
