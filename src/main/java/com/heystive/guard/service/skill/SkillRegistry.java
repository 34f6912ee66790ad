package com.heystive.guard.service.skill;

import com.heystive.guard.config.sandbox.SandboxProperties;
import com.heystive.guard.domain.SkillManifest;
import com.heystive.guard.service.permission.PermissionStore;
import com.heystive.guard.service.sandbox.SkillSandboxExecutor;
import com.heystive.guard.service.security.SecurityContext;
import com.heystive.guard.service.skill.builtin.CalcSkill;
import com.heystive.guard.service.skill.builtin.NoteSkill;
import com.heystive.guard.service.skill.builtin.OpenUrlSkill;
import com.heystive.guard.service.skill.builtin.TimeSkill;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Priority-ordered list of skills: the built-ins ({@code note}, {@code time}, {@code calc},
 * {@code open_url}) first, then manifest skills by name.
 *
 * <p>{@link #reload()} rescans the skills directory; readers always see a complete list.
 */
@Component
public class SkillRegistry {

    private static final Logger LOG = LogManager.getLogger(SkillRegistry.class);

    private final List<Skill> builtins;
    private final Supplier<List<Skill>> manifestSource;
    private volatile List<Skill> skills;

    @Autowired
    public SkillRegistry(SecurityContext securityContext,
                         SandboxProperties sandboxProperties,
                         SkillSandboxExecutor executor,
                         PermissionStore permissionStore) {
        this(defaultBuiltins(securityContext), () -> {
            List<Skill> loaded = new ArrayList<>();
            for (SkillManifest manifest : SkillManifestLoader.loadAll(Path.of(sandboxProperties.getSkillsDir()))) {
                loaded.add(new ManifestSkill(manifest, executor, permissionStore, securityContext.events()));
            }
            return loaded;
        });
    }

    SkillRegistry(List<Skill> builtins, Supplier<List<Skill>> manifestSource) {
        this.builtins = List.copyOf(builtins);
        this.manifestSource = manifestSource;
        this.skills = assemble();
    }

    private static List<Skill> defaultBuiltins(SecurityContext securityContext) {
        return List.of(
                new NoteSkill(securityContext.clock()),
                new TimeSkill(securityContext.clock()),
                new CalcSkill(),
                new OpenUrlSkill());
    }

    /**
     * Rescans manifest skills. Built-ins are unaffected.
     *
     * @return number of registered skills after the reload
     */
    public int reload() {
        this.skills = assemble();
        return skills.size();
    }

    /** Skills in routing priority order. */
    public List<Skill> skills() {
        return skills;
    }

    public Optional<Skill> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Skill skill : skills) {
            if (skill.name().equals(name)) {
                return Optional.of(skill);
            }
        }
        return Optional.empty();
    }

    private List<Skill> assemble() {
        List<Skill> assembled = new ArrayList<>(builtins);
        Set<String> names = new HashSet<>();
        builtins.forEach(s -> names.add(s.name()));
        for (Skill skill : manifestSource.get()) {
            if (!names.add(skill.name())) {
                LOG.warn("Ignoring manifest skill '{}': name already registered", skill.name());
                continue;
            }
            assembled.add(skill);
        }
        LOG.info("Skill registry: {} skill(s) {}", assembled.size(),
                assembled.stream().map(Skill::name).toList());
        return List.copyOf(assembled);
    }
}
