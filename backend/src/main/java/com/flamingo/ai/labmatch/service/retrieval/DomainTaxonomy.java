package com.flamingo.ai.labmatch.service.retrieval;

import java.util.List;
import java.util.Locale;

/** Fixed dictionary of research domains and the terms that signal them. */
public final class DomainTaxonomy {

  /**
   * A research domain.
   *
   * @param name stable category identifier
   * @param variants lowercase term variants in Korean and English
   * @param weight caps the category's contribution, in (0, 1]
   */
  public record Category(String name, List<String> variants, double weight) {

    public Category {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Category name must not be blank");
      }
      if (variants == null || variants.isEmpty()) {
        throw new IllegalArgumentException("Category " + name + " has no variants");
      }
      if (weight <= 0 || weight > 1) {
        throw new IllegalArgumentException(
            "Category " + name + " weight must be in (0, 1]: " + weight);
      }
      variants = variants.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
  }

  private final List<Category> categories;

  public DomainTaxonomy(List<Category> categories) {
    this.categories = List.copyOf(categories);
  }

  public List<Category> getCategories() {
    return categories;
  }

  /** Built-in taxonomy for engineering and science labs. */
  public static DomainTaxonomy defaults() {
    return new DomainTaxonomy(
        List.of(
            new Category(
                "computer_vision",
                List.of(
                    "computer vision", "컴퓨터 비전", "컴퓨터비전", "image recognition", "이미지 인식",
                    "object detection", "객체 탐지", "image processing", "영상 처리", "영상처리",
                    "영상 분석", "이미지 분류", "image classification", "segmentation"),
                1.0),
            new Category(
                "natural_language_processing",
                List.of(
                    "natural language", "nlp", "자연어", "language model", "언어 모델", "언어모델",
                    "text mining", "텍스트 마이닝", "대화형", "chatbot", "챗봇", "machine translation",
                    "기계 번역"),
                1.0),
            new Category(
                "machine_learning",
                List.of(
                    "machine learning", "머신러닝", "머신 러닝", "기계학습", "deep learning", "딥러닝",
                    "neural network", "신경망", "인공지능", "artificial intelligence",
                    "reinforcement learning", "강화학습"),
                0.8),
            new Category(
                "robotics",
                List.of(
                    "robot", "robotics", "로봇", "autonomous driving", "자율주행", "drone", "드론",
                    "manipulator", "매니퓰레이터", "slam"),
                1.0),
            new Category(
                "control_systems",
                List.of("control system", "제어", "controller", "제어기", "optimal control", "mpc"),
                1.0),
            new Category(
                "power_energy",
                List.of(
                    "power system", "전력", "smart grid", "스마트 그리드", "스마트그리드", "에너지",
                    "energy", "battery", "배터리", "신재생", "renewable"),
                1.0),
            new Category(
                "communications",
                List.of(
                    "wireless", "무선", "통신", "communication", "5g", "6g", "computer network",
                    "network protocol", "네트워크", "안테나", "antenna"),
                1.0),
            new Category(
                "semiconductors",
                List.of(
                    "semiconductor", "반도체", "integrated circuit", "집적회로", "회로 설계",
                    "circuit design", "vlsi", "소자", "fpga"),
                1.0),
            new Category(
                "biomedical",
                List.of(
                    "biomedical", "바이오", "의료", "medical", "healthcare", "헬스케어", "생체", "유전체",
                    "genomics", "bioinformatics"),
                1.0),
            new Category(
                "security",
                List.of(
                    "security", "보안", "암호", "cryptography", "privacy", "프라이버시", "blockchain",
                    "블록체인"),
                1.0),
            new Category(
                "data_systems",
                List.of(
                    "database", "데이터베이스", "big data", "빅데이터", "distributed system",
                    "분산 시스템", "cloud", "클라우드", "data mining", "데이터 마이닝"),
                1.0),
            new Category(
                "materials_chemistry",
                List.of(
                    "materials", "소재", "재료", "chemical", "화학", "catalyst", "촉매", "polymer",
                    "고분자", "nanomaterial", "나노"),
                1.0)));
  }
}
