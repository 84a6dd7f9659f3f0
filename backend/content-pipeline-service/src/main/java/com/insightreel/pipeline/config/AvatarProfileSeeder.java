package com.insightreel.pipeline.config;

import com.insightreel.pipeline.entity.AvatarProfile;
import com.insightreel.pipeline.repository.AvatarProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Seeds avatar profiles from {@code pipeline.avatars.seed} on startup.
 * Existing profile ids are left untouched.
 *
 * Profiles:
 * - default: Runs automatically
 * - no-seed: Skip seeding
 */
@Component
@Profile("!no-seed")
@RequiredArgsConstructor
@Slf4j
public class AvatarProfileSeeder implements ApplicationRunner {

    private final AvatarProfileRepository avatarProfileRepository;
    private final PipelineProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        PipelineProperties.Avatars avatars = properties.getAvatars();
        if (!avatars.isSeedEnabled()) {
            log.info("Avatar profile seeding is disabled via configuration.");
            return;
        }
        List<PipelineProperties.Seed> seeds = avatars.getSeed();
        if (seeds == null || seeds.isEmpty()) {
            log.info("No avatar profiles configured for seeding.");
            return;
        }

        int created = 0;
        int skipped = 0;
        for (int i = 0; i < seeds.size(); i++) {
            PipelineProperties.Seed seed = seeds.get(i);
            if (seed.getId() == null || avatarProfileRepository.existsById(seed.getId())) {
                skipped++;
                continue;
            }
            avatarProfileRepository.save(AvatarProfile.builder()
                    .id(seed.getId())
                    .name(seed.getName() != null ? seed.getName() : seed.getId())
                    .providerAvatarId(seed.getProviderAvatarId())
                    .voiceId(seed.getVoiceId())
                    .subscriptionTier(seed.getTier())
                    .defaultProfile(seed.isDefaultProfile())
                    .active(true)
                    .displayOrder(i)
                    .build());
            created++;
        }
        log.info("Seeded avatar profiles. created={}, skipped={}, totalDesired={}", created, skipped, seeds.size());
    }
}
