package registrationND;

public class ConstantsRegistrationND {

	public static final String sVersion = "0.1.0";
	
	/** prefix of keys stored in ImageJ Prefs **/
	public static final String sPrefs = "RegistrationND.";
}
