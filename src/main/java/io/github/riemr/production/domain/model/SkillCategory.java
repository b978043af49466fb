package io.github.riemr.production.domain.model;

/**
 * 作業者・工程のスキル区分。OTHER は縫製以外の全般作業を指す。
 */
public enum SkillCategory {
    SEWING,
    OTHER
}
