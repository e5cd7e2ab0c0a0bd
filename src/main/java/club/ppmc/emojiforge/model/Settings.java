/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化 EmojiForge 的各项配置。
 * 这些设置由用户通过界面修改，由 SettingsService 负责加载和保存到数据目录下的 settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.emojiforge.model;

import lombok.Data;

@Data
public class Settings {

    public static final String DEFAULT_MODEL_ID = "black-forest-labs/FLUX.2-klein-4B";
    public static final float DEFAULT_STRENGTH = 0.1f;
    public static final int DEFAULT_NUM_INFERENCE_STEPS = 30;
    public static final float DEFAULT_CFG_SCALE = 1.0f;
    public static final float DEFAULT_BACKGROUND_REMOVAL_STRENGTH = 1.0f;

    // --- 后端进程 ---
    /**
     * Python 解释器的可执行文件路径，例如 "python" 或 "/opt/venv/bin/python"。
     */
    private String pythonExecutablePath = "python";

    /**
     * 后端入口脚本 main.py 的路径。相对路径会按当前工作目录及其父目录进行查找。
     */
    private String backendScriptPath = "src/emojiforge_backend/main.py";

    /**
     * 模型路径，可以是 HuggingFace 仓库ID，也可以是本地目录。
     */
    private String modelPath = DEFAULT_MODEL_ID;

    /**
     * 默认模型下载到本地后的目录。当 modelPath 仍为默认仓库ID且该目录存在时，优先使用本地目录。
     */
    private String modelCacheDirectory;

    /** 通过 HF_TOKEN 环境变量传给后端的访问令牌。 */
    private String huggingFaceToken;

    private String emojiFontPath;

    /** "cuda" 或 "cpu"。 */
    private String device = "cuda";

    private boolean enableCpuOffload;

    // --- 输出 ---
    private String defaultOutputDirectory = "./output";

    // --- 生成参数默认值 ---
    private float strength = DEFAULT_STRENGTH;
    private int numInferenceSteps = DEFAULT_NUM_INFERENCE_STEPS;
    private float cfgScale = DEFAULT_CFG_SCALE;
    private long seed = 42;
    private boolean randomSeed = true;
    private int outputSizePx = 512;
    private boolean removeBackground = true;
    private float backgroundRemovalStrength = DEFAULT_BACKGROUND_REMOVAL_STRENGTH;
}
