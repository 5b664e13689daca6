package catisim.config;

/**
 * Некорректная конфигурация (популяция, дисперсия, границы фаз, размер выборки).
 * Фатальна: бросается сразу, повторов нет.
 */
public class ConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
