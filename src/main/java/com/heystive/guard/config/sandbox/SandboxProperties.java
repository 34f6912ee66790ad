package com.heystive.guard.config.sandbox;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for command validation and sandboxed skill execution.
 * Binds to properties prefixed with "sandbox".
 *
 * <p>Example application.properties:
 * <pre>
 * sandbox.skills-dir=skills_registry
 * sandbox.default-timeout-seconds=3
 * sandbox.allowed-executables=espeak,espeak-ng,aplay
 * sandbox.max-stdout-bytes=1048576
 * </pre>
 */
@ConfigurationProperties(prefix = "sandbox")
@Validated
public class SandboxProperties {

    /** Basenames of executables a skill may run. */
    @NotNull
    private Set<String> allowedExecutables = new LinkedHashSet<>(List.of(
            "aplay", "paplay", "ffmpeg", "sox",
            "nvidia-smi", "rocm-smi", "intel_gpu_top", "ping",
            "espeak", "espeak-ng", "festival",
            "nmap", "arp", "host", "dig",
            "which", "whereis", "lsof", "ps", "top", "htop"));

    /** Substrings rejected anywhere in the space-joined argument vector. */
    @NotNull
    private List<String> dangerousPatterns = new ArrayList<>(List.of(
            "&&", "||", ";", "|", ">", "<", ">>",
            "$(", "`", "${",
            "rm ", "del ", "format ", "mkfs",
            "sudo ", "su ", "chmod +s",
            "curl ", "wget ", "nc ", "netcat",
            "python ", "perl ", "ruby ", "bash ", "sh "));

    /** Directories an absolute executable path must live under. */
    @NotNull
    private List<String> safeBinaryDirs = new ArrayList<>(List.of("/usr/bin/", "/bin/", "/usr/local/bin/"));

    /** Root directory holding one sub-directory per installed skill. */
    @NotBlank(message = "Skills directory must not be blank")
    private String skillsDir = "skills_registry";

    @Positive(message = "Default timeout must be positive")
    private long defaultTimeoutSeconds = 3;

    @Positive(message = "Max stdout bytes must be positive")
    private int maxStdoutBytes = 1_048_576;

    @Positive(message = "Max stderr bytes must be positive")
    private int maxStderrBytes = 65_536;

    @Positive(message = "Error snippet length must be positive")
    private int errorSnippetMaxChars = 2000;

    public Set<String> getAllowedExecutables() {
        return allowedExecutables;
    }

    public void setAllowedExecutables(Set<String> allowedExecutables) {
        this.allowedExecutables = allowedExecutables;
    }

    public List<String> getDangerousPatterns() {
        return dangerousPatterns;
    }

    public void setDangerousPatterns(List<String> dangerousPatterns) {
        this.dangerousPatterns = dangerousPatterns;
    }

    public List<String> getSafeBinaryDirs() {
        return safeBinaryDirs;
    }

    public void setSafeBinaryDirs(List<String> safeBinaryDirs) {
        this.safeBinaryDirs = safeBinaryDirs;
    }

    public String getSkillsDir() {
        return skillsDir;
    }

    public void setSkillsDir(String skillsDir) {
        this.skillsDir = skillsDir;
    }

    public long getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public void setDefaultTimeoutSeconds(long defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    public int getMaxStderrBytes() {
        return maxStderrBytes;
    }

    public void setMaxStderrBytes(int maxStderrBytes) {
        this.maxStderrBytes = maxStderrBytes;
    }

    public int getErrorSnippetMaxChars() {
        return errorSnippetMaxChars;
    }

    public void setErrorSnippetMaxChars(int errorSnippetMaxChars) {
        this.errorSnippetMaxChars = errorSnippetMaxChars;
    }
}
